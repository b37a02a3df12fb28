/**
 * Asynchronous hand-off of readings to long-term storage.
 */
package com.phillippitts.grillstats.service.history;
