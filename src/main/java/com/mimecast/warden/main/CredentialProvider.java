package com.mimecast.warden.main;

import org.apache.commons.lang3.StringUtils;

import java.io.Console;
import java.util.Map;

/**
 * Looks up the account password.
 * <p>Order: environment variable, then command line value, then an interactive prompt.
 */
public class CredentialProvider {

    /**
     * Environment variable holding the password.
     */
    public static final String ENV_PASSWORD = "WARDEN_PASSWORD";

    private final Map<String, String> environment;
    private final Console console;

    public CredentialProvider() {
        this(System.getenv(), System.console());
    }

    /**
     * Constructs a new CredentialProvider instance.
     *
     * @param environment Environment variables.
     * @param console     Console for prompting, may be null.
     */
    public CredentialProvider(Map<String, String> environment, Console console) {
        this.environment = environment;
        this.console = console;
    }

    /**
     * Resolves the password.
     *
     * @param cliValue Value given on the command line, may be null.
     * @return Password or null if none is available.
     */
    public String getPassword(String cliValue) {
        String value = environment.get(ENV_PASSWORD);
        if (StringUtils.isNotEmpty(value)) {
            return value;
        }
        if (StringUtils.isNotEmpty(cliValue)) {
            return cliValue;
        }
        if (console != null) {
            char[] typed = console.readPassword("Password: ");
            if (typed != null && typed.length > 0) {
                return new String(typed);
            }
        }
        return null;
    }
}
