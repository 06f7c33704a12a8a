package com.eainde.labreport.proximity;

import java.util.List;

/**
 * Rebuilds {@code label: value (норма: range)} lines from OCR fragments whose row
 * structure was lost. Implementations only produce text; parsing is shared.
 */
public interface FragmentReconstructor {

    String name();

    /**
     * @param fragments non-blank, stripped fragments in emission order
     * @return synthetic metric lines, possibly empty
     */
    List<String> reconstruct(List<String> fragments);
}
