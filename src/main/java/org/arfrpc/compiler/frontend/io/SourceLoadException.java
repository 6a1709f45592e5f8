package org.arfrpc.compiler.frontend.io;

import java.io.IOException;
import java.nio.file.InvalidPathException;

/**
 * Thrown by a {@link SourceLoader} when a source unit cannot be loaded. The message is
 * suitable for inclusion in an import diagnostic.
 */
public class SourceLoadException extends IOException {

    /**
     * Why loading failed.
     */
    public enum Reason {
        NOT_FOUND,
        IS_DIRECTORY,
        UNREADABLE,
        /** The path cannot be represented on this platform, e.g. it contains a NUL character. */
        INVALID_PATH
    }

    private final Reason reason;
    private final String path;

    public SourceLoadException(Reason reason, String path, String message) {
        super(message);
        this.reason = reason;
        this.path = path;
    }

    public SourceLoadException(Reason reason, String path, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.path = path;
    }

    public Reason getReason() {
        return reason;
    }

    public String getPath() {
        return path;
    }

    public static SourceLoadException notFound(String path) {
        return new SourceLoadException(Reason.NOT_FOUND, path, "file " + path + " does not exist");
    }

    public static SourceLoadException directory(String path) {
        return new SourceLoadException(Reason.IS_DIRECTORY, path, path + " is a directory");
    }

    public static SourceLoadException invalidPath(String path, InvalidPathException cause) {
        return new SourceLoadException(Reason.INVALID_PATH, path,
                "\"" + path + "\" is not a valid path (" + cause.getReason() + ")", cause);
    }

    public static SourceLoadException unreadable(String path, Throwable cause) {
        String detail = cause == null || cause.getMessage() == null ? "" : " (" + cause.getMessage() + ")";
        return new SourceLoadException(Reason.UNREADABLE, path, path + " could not be read" + detail, cause);
    }
}
