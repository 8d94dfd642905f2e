package com.shapecraft.generator.codegen.exception;

import lombok.Getter;

/**
 * Two structurally different shapes produced the same content hash. Fatal for
 * the whole run.
 */
@Getter
public class IdentityCollisionException extends ProjectionException {
    private static final long serialVersionUID = 1L;

    private final String hash;

    public IdentityCollisionException(String hash, String existingSignature, String newSignature) {
        super("Content hash " + hash + " is shared by different structures:\n  " + existingSignature
                + "\n  " + newSignature);
        this.hash = hash;
    }
}
