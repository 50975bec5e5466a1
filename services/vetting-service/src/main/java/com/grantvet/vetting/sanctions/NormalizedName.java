package com.grantvet.vetting.sanctions;

import lombok.Value;

/**
 * Output of {@link NameNormalizer}: lowercase ASCII words separated by single spaces.
 */
@Value
public class NormalizedName {

    String value;

    public boolean isEmpty() {
        return value.isEmpty();
    }

    public int length() {
        return value.length();
    }

    @Override
    public String toString() {
        return value;
    }
}
