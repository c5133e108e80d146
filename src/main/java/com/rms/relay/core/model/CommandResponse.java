package com.rms.relay.core.model;

/**
 * Result of a cloud command invocation: a caller-configured status code and a
 * JSON-encoded response body.
 *
 * On success {@code response} is the JSON of the local service result; on
 * failure it is a JSON string holding the failure description.
 */
public record CommandResponse(int status, String response) {
}
