package com.sporty.qcache.example;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Field name to accessor table used to evaluate criteria and sorts against members.
 */
final class MemberFields {
    private static final Map<String, Function<Member, Object>> ACCESSORS = Map.of(
            "id", Member::getId,
            "name", Member::getName,
            "age", Member::getAge,
            "team", Member::getTeam,
            "createTime", Member::getCreateTime,
            "updateTime", Member::getUpdateTime
    );

    private MemberFields() {
    }

    static Object valueOf(final Member member, final String field) {
        final Function<Member, Object> accessor = ACCESSORS.get(field);
        if (accessor == null) {
            throw new IllegalArgumentException("Unknown member field: " + field);
        }
        return accessor.apply(member);
    }

    static boolean matches(final Member member, final String field, final Object expected) {
        final Object actual = valueOf(member, field);
        // request parameters and JSON arrive as Integer or String where the field is a Long
        if (actual instanceof Number && expected != null && !(expected instanceof Number)) {
            return actual.toString().equals(expected.toString());
        }
        if (actual instanceof Number number && expected instanceof Number other) {
            return number.longValue() == other.longValue();
        }
        return Objects.equals(actual, expected);
    }
}
