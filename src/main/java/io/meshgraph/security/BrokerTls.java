package io.meshgraph.security;

import io.meshgraph.config.BrokerSettings;
import io.meshgraph.config.ConfigurationException;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.X509Certificate;

/**
 * TLS socket factory for the broker connection. Public mesh brokers commonly run with
 * self-signed certificates, so certificate checks are off unless a truststore is given
 * or {@code TLS_INSECURE} is false.
 */
public final class BrokerTls {
    private BrokerTls() {
    }

    public static SSLSocketFactory socketFactory(BrokerSettings settings) {
        try {
            TrustManager[] trustManagers;
            if (settings.truststorePath() != null && !settings.truststorePath().isBlank()) {
                trustManagers = fromTruststore(Path.of(settings.truststorePath()), settings.truststorePassword());
            } else if (settings.tlsInsecure()) {
                trustManagers = new TrustManager[]{new TrustAllManager()};
            } else {
                trustManagers = null;
            }
            SSLContext ssl = SSLContext.getInstance("TLS");
            ssl.init(null, trustManagers, null);
            return ssl.getSocketFactory();
        } catch (GeneralSecurityException | IOException e) {
            throw new ConfigurationException("Failed to build TLS context for " + settings.serverUri(), e);
        }
    }

    private static TrustManager[] fromTruststore(Path path, String password)
            throws GeneralSecurityException, IOException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("TLS_TRUSTSTORE not found: " + path);
        }
        String lower = path.getFileName().toString().toLowerCase();
        String type = lower.endsWith(".jks") ? "JKS" : "PKCS12";
        KeyStore store = KeyStore.getInstance(type);
        try (InputStream in = Files.newInputStream(path)) {
            store.load(in, password == null ? new char[0] : password.toCharArray());
        }
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(store);
        return tmf.getTrustManagers();
    }

    private static final class TrustAllManager implements X509TrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
