// core/spi/PlayNormalizer.java
package com.scorebook.core.spi;

import com.scorebook.core.model.PlayContext;
import com.scorebook.core.model.PlayEvent;
import com.scorebook.core.model.RawPlay;

public interface PlayNormalizer {
  /**
   * Clasifica el texto y resuelve el movimiento de corredores contra {@code context}.
   * Si ninguna regla aplica lanza {@code UnrecognizedPlayPatternException}, que trae un evento fallback usable.
   */
  PlayEvent normalize(RawPlay raw, PlayContext context);
}
