/**
 * Threshold alerts with debounce and hysteresis, and their delivery to notification senders.
 */
package com.phillippitts.grillstats.service.alert;
