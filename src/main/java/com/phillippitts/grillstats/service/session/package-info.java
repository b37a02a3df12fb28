/**
 * Cooking-session simulation: sessions, the engine that advances them, events and the
 * simulated device status clock.
 */
package com.phillippitts.grillstats.service.session;
