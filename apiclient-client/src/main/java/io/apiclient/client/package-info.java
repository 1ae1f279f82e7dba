/**
 * The API client: configuration, stub substitution and the callback, blocking and
 * {@link java.util.concurrent.Flow} call styles over one shared pipeline.
 */
package io.apiclient.client;
