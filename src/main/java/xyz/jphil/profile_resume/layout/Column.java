package xyz.jphil.profile_resume.layout;

import xyz.jphil.profile_resume.model.Line;

import java.util.OptionalDouble;

public enum Column {
    LEFT, RIGHT;

    /**
     * Column of a line; without a detected split everything is LEFT
     */
    public static Column of(Line line, OptionalDouble split) {
        return split.isPresent() && line.left() > split.getAsDouble() ? RIGHT : LEFT;
    }

    public Column opposite() {
        return this == LEFT ? RIGHT : LEFT;
    }
}
