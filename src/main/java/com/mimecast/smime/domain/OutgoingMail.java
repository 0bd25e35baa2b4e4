package com.mimecast.smime.domain;

import java.util.List;
import java.util.Objects;

/**
 * An already composed outgoing message handed over for protection.
 *
 * <p>{@code content} is the encoded MIME entity (headers, blank line, body) that gets signed or encrypted.
 */
public class OutgoingMail {

    private final String from;
    private final List<String> to;
    private final List<String> cc;
    private final byte[] content;

    /**
     * Constructs a new OutgoingMail instance.
     *
     * @param from    Sender address.
     * @param to      To recipients, may be null.
     * @param cc      Cc recipients, may be null.
     * @param content Encoded MIME entity.
     */
    public OutgoingMail(String from, List<String> to, List<String> cc, byte[] content) {
        this.from = from;
        this.to = to != null ? List.copyOf(to) : List.of();
        this.cc = cc != null ? List.copyOf(cc) : List.of();
        this.content = Objects.requireNonNull(content, "content");
    }

    public String getFrom() {
        return from;
    }

    public List<String> getTo() {
        return to;
    }

    public List<String> getCc() {
        return cc;
    }

    public byte[] getContent() {
        return content;
    }
}
