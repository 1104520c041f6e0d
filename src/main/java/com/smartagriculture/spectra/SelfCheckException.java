package com.smartagriculture.spectra;

/**
 * Raised inside {@link SelfCheckValidator} when a validation condition fails. Never escapes the validator:
 * it becomes the FAIL report.
 */
public class SelfCheckException extends Exception {
    private final SelfCheckStage stage;

    public SelfCheckException(SelfCheckStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public SelfCheckStage getStage() {
        return stage;
    }
}
