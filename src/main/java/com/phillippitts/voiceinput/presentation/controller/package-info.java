/**
 * REST controllers.
 *
 * <ul>
 *   <li>{@code GET /ping} - liveness</li>
 *   <li>{@code GET /api/state} - last rendered state, translate flag, download progress</li>
 *   <li>{@code POST /api/model} - switch the model family</li>
 *   <li>{@code POST /api/model/load} - reload (or re-download) a model family</li>
 *   <li>{@code POST /api/shutdown} - stop the pipeline</li>
 * </ul>
 */
package com.phillippitts.voiceinput.presentation.controller;
