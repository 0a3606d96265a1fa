package com.autonomous.tasks.util;

import java.util.UUID;
import java.util.regex.Pattern;

public final class TaskIds {

    private static final Pattern CANONICAL_UUID = Pattern.compile(
        "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private TaskIds() {}

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public static boolean isValid(String value) {
        return value != null && CANONICAL_UUID.matcher(value).matches();
    }
}
