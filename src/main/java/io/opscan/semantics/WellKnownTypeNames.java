package io.opscan.semantics;

/**
 * Metadata names of runtime types the rules depend on.
 */
public final class WellKnownTypeNames {

    public static final String SYSTEM_OBJECT = "System.Object";
    public static final String SYSTEM_BOOLEAN = "System.Boolean";
    public static final String SYSTEM_IDISPOSABLE = "System.IDisposable";
    public static final String SYSTEM_INTPTR = "System.IntPtr";
    public static final String SYSTEM_UINTPTR = "System.UIntPtr";
    public static final String SYSTEM_RUNTIME_INTEROPSERVICES_HANDLEREF = "System.Runtime.InteropServices.HandleRef";

    public static final String SYSTEM_NET_SECURITY_REMOTE_CERTIFICATE_VALIDATION_CALLBACK =
            "System.Net.Security.RemoteCertificateValidationCallback";
    public static final String SYSTEM_NET_SECURITY_SSL_POLICY_ERRORS = "System.Net.Security.SslPolicyErrors";
    public static final String SYSTEM_SECURITY_CRYPTOGRAPHY_X509_CERTIFICATE =
            "System.Security.Cryptography.X509Certificates.X509Certificate";
    public static final String SYSTEM_SECURITY_CRYPTOGRAPHY_X509_CHAIN =
            "System.Security.Cryptography.X509Certificates.X509Chain";

    private WellKnownTypeNames() {
    }
}
