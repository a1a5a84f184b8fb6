package com.chemdata.dwar.model;

import java.util.Locale;
import java.util.Optional;

import lombok.Data;

/**
 * Typing attributes declared for one column inside the column properties block.
 */
@Data
public class ColumnProperties {

    public static final String DEFAULT_TYPE = "string";
    public static final String IDCODE = "idcode";

    private String type = DEFAULT_TYPE;
    private String specialType;
    private String parent;

    public Optional<String> findSpecialType() {
        return Optional.ofNullable(specialType);
    }

    public Optional<String> findParent() {
        return Optional.ofNullable(parent);
    }

    /**
     * True when the column holds encoded structures (specialType idcode, any case).
     */
    public boolean isIdcode() {
        return specialType != null && IDCODE.equals(specialType.toLowerCase(Locale.ROOT));
    }
}
