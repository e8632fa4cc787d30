package com.team.testcaseimport.model.patch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * JSON Patch 文件中的單一操作（application/json-patch+json）。
 * 只能透過 add / replace / remove 建立，remove 不帶 value。
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PatchOperation {

    private final Op op;
    private final String path;
    private final Object value;

    private PatchOperation(Op op, String path, Object value) {
        this.op = op;
        this.path = path;
        this.value = value;
    }

    public static PatchOperation add(String path, Object value) {
        return new PatchOperation(Op.ADD, path, requireValue(value, path));
    }

    public static PatchOperation replace(String path, Object value) {
        return new PatchOperation(Op.REPLACE, path, requireValue(value, path));
    }

    public static PatchOperation remove(String path) {
        return new PatchOperation(Op.REMOVE, path, null);
    }

    /**
     * 欄位路徑，例如 /fields/System.Title。
     */
    public static String fieldPath(String referenceName) {
        return "/fields/" + referenceName;
    }

    private static Object requireValue(Object value, String path) {
        if (value == null) {
            throw new IllegalArgumentException("Patch operation on " + path + " requires a value");
        }
        return value;
    }

    public enum Op {
        ADD,
        REPLACE,
        REMOVE;

        @JsonValue
        public String toJson() {
            return name().toLowerCase();
        }
    }
}
