package com.metrocrawler.exception;

import lombok.Getter;

@Getter
public class AssemblyException extends CrawlException {

    public enum Kind {
        EMPTY_SYSTEM
    }

    private final Kind kind;
    private final String systemId;

    public AssemblyException(Kind kind, String systemId, String message) {
        super(message);
        this.kind = kind;
        this.systemId = systemId;
    }

    @Override
    public String getReason() {
        return kind.name();
    }
}
