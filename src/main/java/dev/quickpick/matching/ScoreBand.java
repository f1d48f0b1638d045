package dev.quickpick.matching;

/**
 * Inclusive score range reserved for one matching strategy. Bands of the ladder do not overlap,
 * so a stronger strategy outranks a weaker one whatever the penalties.
 *
 * @param floor lowest score of the band
 * @param ceiling highest score of the band
 */
record ScoreBand(int floor, int ceiling) {

  ScoreBand {
    if (floor < 1 || ceiling < floor) {
      throw new IllegalArgumentException("Invalid score band [" + floor + ", " + ceiling + "]");
    }
  }

  int clamp(int raw) {
    return Math.max(floor, Math.min(ceiling, raw));
  }
}
