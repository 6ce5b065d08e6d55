package de.bsommerfeld.golinks.core.domain;

/**
 * A freshly created API token. The plaintext is only available here and
 * cannot be recovered from the store afterwards.
 */
public record IssuedToken(String plaintext, ApiToken token) {

    @Override
    public String toString() {
        return "IssuedToken[plaintext=***, token=" + token + "]";
    }
}
