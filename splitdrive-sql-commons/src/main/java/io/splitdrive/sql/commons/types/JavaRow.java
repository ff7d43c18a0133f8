package io.splitdrive.sql.commons.types;

import java.util.Arrays;
import java.util.List;

public record JavaRow(Object[] objects) {

    public static JavaRow of(Object... objects) {
        return new JavaRow(objects);
    }

    public Object get(int index) {
        return objects[index];
    }

    public void set(int index, Object object) {
        objects[index] = object;
    }

    public int size() {
        return objects.length;
    }

    /**
     * Values as a list so that rows can be compared and hashed by content.
     */
    public List<Object> values() {
        return Arrays.asList(objects);
    }

    @Override
    public String toString() {
        return Arrays.toString(objects);
    }
}
