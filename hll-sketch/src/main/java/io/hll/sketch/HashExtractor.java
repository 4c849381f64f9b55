package io.hll.sketch;

import com.google.common.hash.Funnel;

/**
 * Maps a value to the register it may raise.
 */
public interface HashExtractor
{
  int precision();

  <T> RegisterUpdate extract(T value, Funnel<? super T> funnel);

  RegisterUpdate extract(byte[] value);

  RegisterUpdate extract(long value);

  RegisterUpdate extract(CharSequence value);
}
