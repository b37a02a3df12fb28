/**
 * Small static helpers shared across layers.
 */
package com.phillippitts.grillstats.util;
