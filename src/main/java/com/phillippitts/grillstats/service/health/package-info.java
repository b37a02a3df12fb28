/**
 * Actuator health indicators.
 */
package com.phillippitts.grillstats.service.health;
