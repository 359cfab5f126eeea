package io.confluent.csid.utils;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import lombok.experimental.UtilityClass;
import org.slf4j.helpers.MessageFormatter;

@UtilityClass
public class StringUtils {

    /**
     * Formats using the slf4j {@code {}} placeholder convention, so exception messages read like log lines.
     *
     * @see MessageFormatter#arrayFormat(String, Object[])
     */
    public static String msg(String s, Object... args) {
        return MessageFormatter.arrayFormat(s, args).getMessage();
    }

    public static boolean isBlank(final String property) {
        return property == null || property.isBlank();
    }
}
