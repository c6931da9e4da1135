package com.mimecast.warden.smtp;

/**
 * Outgoing delivery credentials.
 * <p>Read-only and shared by reference between handlers.
 */
public final class Credentials {

    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final boolean ssl;

    /**
     * Constructs a new Credentials instance.
     *
     * @param host     SMTP host.
     * @param port     SMTP port.
     * @param user     Login.
     * @param password Password.
     * @param ssl      Implicit TLS, otherwise STARTTLS.
     */
    public Credentials(String host, int port, String user, String password, boolean ssl) {
        this.host = host;
        this.port = port;
        this.user = user;
        this.password = password;
        this.ssl = ssl;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUser() {
        return user;
    }

    public String getPassword() {
        return password;
    }

    public boolean isSsl() {
        return ssl;
    }

    @Override
    public String toString() {
        return "Credentials{" + user + "@" + host + ":" + port + (ssl ? " ssl" : "") + "}";
    }
}
