package com.tfve.sync.core.value;

/**
 * Result of {@link ValueCodec#classify(Value)}.
 *
 * @param primitive true for boolean, integer, float and string values
 * @param string true only for string values (sent and read back verbatim)
 */
public record Classification(boolean primitive, boolean string) {

    /**
     * Value of the {@code hcl} attribute in the outgoing variable payload.
     */
    public boolean hcl() {
        return !primitive;
    }
}
