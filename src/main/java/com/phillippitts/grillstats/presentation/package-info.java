/**
 * HTTP boundary of the service: controllers in {@code presentation.controller}, exception
 * mapping in {@code presentation.exception}. Presentation depends on service, never the
 * reverse.
 */
package com.phillippitts.grillstats.presentation;
