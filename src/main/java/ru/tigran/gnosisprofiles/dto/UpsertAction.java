package ru.tigran.gnosisprofiles.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of an upsert: a new row was inserted or an existing one was changed.
 */
public enum UpsertAction {
    CREATED("created"),
    UPDATED("updated");

    private final String value;

    UpsertAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static UpsertAction of(boolean isUpdate) {
        return isUpdate ? UPDATED : CREATED;
    }
}
