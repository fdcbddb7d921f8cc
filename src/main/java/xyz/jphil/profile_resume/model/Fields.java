package xyz.jphil.profile_resume.model;

import java.util.List;

/**
 * Null guards keeping every record field present: absent text is "" and absent lists are empty
 */
final class Fields {

    private Fields() {
    }

    static String text(String value) {
        return value == null ? "" : value;
    }

    static <T> List<T> list(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    static boolean allBlank(String... values) {
        for (var value : values) {
            if (value != null && !value.isBlank()) return false;
        }
        return true;
    }
}
