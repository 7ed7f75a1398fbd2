package com.archivist.server.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


@Data
@EqualsAndHashCode(callSuper = false)
public class ArchivistException extends RuntimeException {

    private HttpStatus status;

    public ArchivistException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public ArchivistException(HttpStatus status, Throwable cause) {
        super(cause);
        this.status = status;
    }

    public ArchivistException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public ArchivistException(String message) {
        super(message);
    }

    public ArchivistException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getArchivistMessage() {
        StringBuilder sb = new StringBuilder();
        buildMessageChain(this, sb, 0);
        return sb.toString();
    }

    // <exception name> : <exception message> -> <cause> ...
    private static void buildMessageChain(Throwable throwable, StringBuilder sb, int depth) {
        if (throwable == null || depth > 20) return;
        sb.append("%s : %s -> ".formatted(
                throwable.getClass().getSimpleName(),
                throwable instanceof ArchivistException ? throwable.getMessage() : throwable.toString()));
        buildMessageChain(throwable.getCause(), sb, depth + 1);
    }

    @Override
    public String toString() {
        return getArchivistMessage();
    }
}
