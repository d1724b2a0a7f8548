package com.fastalert.core.transport;

import com.fastalert.core.receiver.TlsSettings;
import org.apache.hc.core5.ssl.SSLContextBuilder;
import org.springframework.boot.ssl.pem.PemContent;

import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * 由 PEM 文本构建 SSLSocketFactory
 * 私钥支持 PKCS#1, PKCS#8 与 SEC1 (EC)
 */
public final class TlsContexts {

    private static final char[] STORE_PASSWORD = "alert-notify".toCharArray();

    private TlsContexts() {
    }

    public static SSLSocketFactory socketFactory(TlsSettings tls) throws IOException {
        try {
            SSLContextBuilder builder = SSLContextBuilder.create();
            if (tls.isInsecureSkipVerify()) {
                builder.loadTrustMaterial((chain, authType) -> true);
            } else if (!isBlank(tls.getCaCertificate())) {
                builder.loadTrustMaterial(trustStore(tls.getCaCertificate()), null);
            }
            if (!isBlank(tls.getClientCertificate()) && !isBlank(tls.getClientKey())) {
                builder.loadKeyMaterial(keyStore(tls.getClientCertificate(), tls.getClientKey()), STORE_PASSWORD);
            }
            return builder.build().getSocketFactory();
        } catch (GeneralSecurityException e) {
            throw new IOException("failed to build tls config: " + e.getMessage(), e);
        }
    }

    static KeyStore trustStore(String caPem) throws GeneralSecurityException, IOException {
        List<X509Certificate> cas = certificates(caPem, "unable to use the provided CA certificate");
        KeyStore store = emptyStore();
        for (int i = 0; i < cas.size(); i++) {
            store.setCertificateEntry("ca-" + i, cas.get(i));
        }
        return store;
    }

    static KeyStore keyStore(String certPem, String keyPem) throws GeneralSecurityException, IOException {
        List<X509Certificate> chain = certificates(certPem, "unable to use the provided client certificate");
        PrivateKey key;
        try {
            key = PemContent.of(keyPem).getPrivateKey();
        } catch (IllegalStateException e) {
            throw new IOException("unable to use the provided client key: " + e.getMessage(), e);
        }
        if (key == null) {
            throw new IOException("unable to use the provided client key");
        }
        KeyStore store = emptyStore();
        store.setKeyEntry("client", key, STORE_PASSWORD, chain.toArray(new Certificate[0]));
        return store;
    }

    private static List<X509Certificate> certificates(String pem, String error) throws IOException {
        List<X509Certificate> certs;
        try {
            certs = PemContent.of(pem).getCertificates();
        } catch (IllegalStateException e) {
            throw new IOException(error + ": " + e.getMessage(), e);
        }
        if (certs == null || certs.isEmpty()) {
            throw new IOException(error);
        }
        return certs;
    }

    private static KeyStore emptyStore() throws GeneralSecurityException, IOException {
        KeyStore store = KeyStore.getInstance("PKCS12");
        store.load(null, null);
        return store;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
