package com.smartagriculture.spectra;

/**
 * Stages of a self-check run, in execution order. REPORT always runs, whether an earlier stage failed or not.
 */
public enum SelfCheckStage {
    LOAD_METADATA,
    VALIDATE_METADATA,
    VALIDATE_OUTPUTS,
    POLICY_CHECK,
    REPORT
}
