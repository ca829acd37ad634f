package com.epcid.common;

/**
 * Recoverable conditions the engine reports instead of throwing.
 * The caller decides how to prompt the user for each one.
 */
public enum EngineError {
    AGE_UNKNOWN,          // date of birth missing, invalid or in the future
    WEIGHT_MISSING,       // no usable weight, prompt for it instead of defaulting
    DRUG_AGE_RESTRICTED,  // hard refusal, e.g. ibuprofen under 6 months
    ESCALATION_EXHAUSTED  // every contact timed out without acknowledging
}
