package com.flamingo.ai.batchplanner.service.token;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Character-ratio estimator: 0.25 tokens per character, or 0.6 when the text contains CJK
 * ideographs, rounded up.
 */
@Component
public class CharRatioTokenEstimator implements TokenEstimator {

  static final double LATIN_RATIO = 0.25;
  static final double CJK_RATIO = 0.6;

  private static final Pattern CJK = Pattern.compile("[\\u4e00-\\u9fff]");

  @Override
  public int estimate(CharSequence text) {
    if (text == null || text.length() == 0) {
      return 0;
    }
    double ratio = CJK.matcher(text).find() ? CJK_RATIO : LATIN_RATIO;
    return (int) Math.ceil(text.length() * ratio);
  }
}
