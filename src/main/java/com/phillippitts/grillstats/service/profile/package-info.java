/**
 * Immutable cooking profiles and the catalogue that serves them.
 *
 * <p>A profile is an ordered list of {@link com.phillippitts.grillstats.service.profile.Phase phases};
 * the session engine walks them in order. Profiles are pure data and safe to share.
 */
package com.phillippitts.grillstats.service.profile;
