/**
 * HTTP boundary of the application: the operator control surface and its error mapping.
 *
 * <p>Presentation depends on the service layer, never the other way round. Controllers
 * are thin: they validate the request, submit an event to the dictation runtime and
 * answer immediately.
 *
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers</li>
 *   <li>{@code presentation.exception} - exception to HTTP status mapping</li>
 * </ul>
 */
package com.phillippitts.voiceinput.presentation;
