/**
 * Live distribution of device updates to dashboard clients over Server-Sent Events.
 */
package com.phillippitts.grillstats.service.stream;
