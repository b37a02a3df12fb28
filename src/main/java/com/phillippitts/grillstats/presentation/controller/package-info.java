/**
 * REST and SSE controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/profiles} - cooking profile catalogue</li>
 *   <li>{@code GET /api/devices}, {@code GET /api/devices/{id}} - devices with status, device snapshot</li>
 *   <li>{@code GET /api/devices/{id}/alerts|rollups} - firing alerts, rollups</li>
 *   <li>{@code POST /api/devices/{id}/connect|disconnect} - start or stop a poll loop</li>
 *   <li>{@code POST|DELETE /api/devices/{id}/channels/{ch}/session}, {@code POST .../events} - simulation control</li>
 *   <li>{@code GET|POST /api/alert-rules}, {@code DELETE /api/alert-rules/{ruleId}}</li>
 *   <li>{@code POST /api/auth/token|logout} - stream session tokens</li>
 *   <li>{@code GET /api/stream/{id}} - Server-Sent Events subscription</li>
 * </ul>
 *
 * <p>Controllers only delegate; {@code GlobalExceptionHandler} turns exceptions into responses.
 */
package com.phillippitts.grillstats.presentation.controller;
