package de.vzg.reposis.crossref.deposit;

/**
 * A deposit could not be generated. Nothing of the batch should be submitted.
 */
public class DepositGenerationException extends RuntimeException {

    public DepositGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
