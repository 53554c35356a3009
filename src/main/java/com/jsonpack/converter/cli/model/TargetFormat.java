package com.jsonpack.converter.cli.model;

/**
 * Format the CLI converts its input into.
 */
public enum TargetFormat {
    /**
     * JSON input, base64 MessagePack output.
     */
    MSGPACK,

    /**
     * Hex or base64 MessagePack input, pretty-printed JSON output.
     */
    JSON
}
