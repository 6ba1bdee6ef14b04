package org.javai.railway.auth;

/**
 * Raw authentication input. Either part may be null or blank; validation rejects both.
 */
public record Credentials(String username, String password) {

    public static Credentials of(String username, String password) {
        return new Credentials(username, password);
    }

    boolean isComplete() {
        return !isBlank(username) && !isBlank(password);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public String toString() {
        return "Credentials[username=" + username + ", password=***]";
    }
}
