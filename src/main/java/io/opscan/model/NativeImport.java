package io.opscan.model;

/**
 * Native-interop marker of a method implemented by an unmanaged entry point.
 *
 * @param library    Native library the entry point is imported from (e.g., "kernel32.dll")
 * @param entryPoint Exported symbol name; defaults to the method name when the host omits it
 */
public record NativeImport(String library, String entryPoint) {

    public NativeImport {
        if (library == null || library.isBlank()) {
            throw new IllegalArgumentException("library cannot be null or blank");
        }
    }
}
