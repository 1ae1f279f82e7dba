package io.apiclient.core;

/**
 * Status code rules shared by endpoints and the response validator.
 */
public final class StatusCodes {
    private StatusCodes() {}

    public static final int NO_CONTENT = 204;

    /**
     * Default acceptance rule: {@code 200 <= code < 300}.
     */
    public static boolean expected200to300(int code) {
        return code >= 200 && code < 300;
    }

    /**
     * Whether a response with this status must carry a body. Only 204 is exempt.
     */
    public static boolean requiresBody(int code) {
        return code != NO_CONTENT;
    }
}
