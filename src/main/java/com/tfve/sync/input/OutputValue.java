package com.tfve.sync.input;

import com.tfve.sync.core.value.Value;

/**
 * One non-sensitive entry of a {@code terraform output -json} document.
 */
public record OutputValue(String name, Value value) {
}
