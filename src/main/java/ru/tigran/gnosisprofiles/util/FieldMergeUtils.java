package ru.tigran.gnosisprofiles.util;

import java.util.function.Consumer;

/**
 * Utility class for partial profile updates.
 * A field is only written when the incoming value is present; null means "keep what is stored".
 */
public class FieldMergeUtils {

    private FieldMergeUtils() {
        // Private constructor to prevent instantiation
    }

    /**
     * Applies the value to the setter unless it is null.
     *
     * Example:
     * mergeIfPresent(request.bio(), user::setBio);
     *
     * @param value  Incoming value, may be null
     * @param setter Entity setter
     * @param <T>    Field type
     */
    public static <T> void mergeIfPresent(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
