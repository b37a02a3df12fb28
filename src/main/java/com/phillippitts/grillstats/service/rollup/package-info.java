/**
 * Periodic min/max/average rollups per channel.
 */
package com.phillippitts.grillstats.service.rollup;
