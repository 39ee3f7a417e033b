/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.cache;

import com.taillens.common.model.LogRecord;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Names of the record fields the engine interprets: the severity level and the two
 * parts of the dotted category path ({@code module} and logger {@code name}).
 *
 * @param levelField  field holding the level name, e.g. {@code levelname}
 * @param moduleField first part of the category path, e.g. {@code module}
 * @param nameField   second part of the category path, e.g. {@code name}
 */
public record RecordFields(String levelField, String moduleField, String nameField) {

    public static final String UNKNOWN_LEVEL = "UNKNOWN";

    public static final RecordFields DEFAULT = new RecordFields("levelname", "module", "name");

    public RecordFields {
        Objects.requireNonNull(levelField, "levelField");
        Objects.requireNonNull(moduleField, "moduleField");
        Objects.requireNonNull(nameField, "nameField");
    }

    /** Upper-cased level of the record, {@value #UNKNOWN_LEVEL} when it has none. */
    public String levelOf(LogRecord record) {
        return record.text(levelField)
                .map(s -> s.trim().toUpperCase(Locale.ROOT))
                .orElse(UNKNOWN_LEVEL);
    }

    /**
     * Dotted category path {@code module.name}. Empty when the record has no module;
     * just the module when it has no name.
     */
    public Optional<String> categoryOf(LogRecord record) {
        Optional<String> module = record.text(moduleField).map(String::trim);
        if (module.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(record.text(nameField)
                .map(name -> module.get() + "." + name.trim())
                .orElse(module.get()));
    }
}
