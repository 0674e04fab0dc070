/**
 * HTTP endpoints of the agent.
 *
 * <p>{@link com.phillippitts.transcriptionagent.presentation.controller.StatusController} answers
 * {@code GET /} and {@code GET /health} with a static liveness document. Detailed health and
 * metrics are served by Spring Boot Actuator under {@code /actuator}.
 */
package com.phillippitts.transcriptionagent.presentation.controller;
