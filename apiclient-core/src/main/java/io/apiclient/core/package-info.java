/**
 * Transport-neutral core of the API client.
 *
 * <p>This module has no third-party dependencies. It contains only:
 * <ul>
 *   <li>The typed endpoint descriptor ({@link io.apiclient.core.RemoteEndpoint}) and its
 *       type-erased projection ({@link io.apiclient.core.AnyEndpoint})</li>
 *   <li>Parse results and structured decode failures</li>
 *   <li>The closed internal error taxonomy ({@link io.apiclient.core.ClientError})</li>
 *   <li>Response validation and small URL helpers</li>
 * </ul>
 *
 * <p>HTTP transports and JSON bindings live in other modules.
 */
package io.apiclient.core;
