/**
 * Transport SPI: the asynchronous request executor the API client sends through.
 *
 * <p>{@link io.apiclient.http.spi.JdkHttpClientAdapter} is the default and needs nothing beyond
 * the JDK. {@link io.apiclient.http.spi.OkHttpClientAdapter} and
 * {@link io.apiclient.http.spi.ApacheHttpClientAdapter} require OkHttp or Apache HttpClient 5
 * on the classpath.
 */
package io.apiclient.http.spi;
