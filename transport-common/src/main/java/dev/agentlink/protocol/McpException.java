package dev.agentlink.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Typed failure of a protocol operation. Remote error responses are converted into this type on
 * the caller's thread; it is never thrown inside a connection's reader.
 */
public class McpException extends Exception {

    private final ErrorCode errorCode;
    private final int code;
    private final transient JsonNode data;

    public McpException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public McpException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    public McpException(ErrorCode errorCode, String message, JsonNode data, Throwable cause) {
        this(errorCode, errorCode.code(), message, data, cause);
    }

    private McpException(ErrorCode errorCode, int code, String message, JsonNode data, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.code = code;
        this.data = data;
    }

    /**
     * Converts an error response. Codes outside the known taxonomy keep their numeric value and
     * are classified as {@link ErrorCode#INTERNAL_ERROR}.
     */
    public static McpException fromRpcError(RpcError error) {
        ErrorCode resolved = ErrorCode.fromCode(error.code()).orElse(ErrorCode.INTERNAL_ERROR);
        return new McpException(resolved, error.code(), error.message(), error.data(), null);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Numeric code as received or as it would be sent.
     */
    public int getCode() {
        return code;
    }

    public JsonNode getData() {
        return data;
    }

    public RpcError toRpcError() {
        return new RpcError(code, getMessage(), data);
    }
}
