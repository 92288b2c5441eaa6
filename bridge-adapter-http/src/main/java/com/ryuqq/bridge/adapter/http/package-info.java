/**
 * HTTP adapter: embedded Jetty routes over {@code KnowledgeService} and an OkHttp CLI.
 *
 * <ul>
 *   <li>{@code server}: {@code KnowledgeHttpServer}, {@code KnowledgeRoutesServlet}, {@code ServerConfig}, bootstrap</li>
 *   <li>{@code json}: Jackson mapper and request/response records</li>
 *   <li>{@code cli}: {@code KnowledgeCli}</li>
 * </ul>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.adapter.http;
