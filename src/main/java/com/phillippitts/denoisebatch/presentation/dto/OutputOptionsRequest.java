package com.phillippitts.denoisebatch.presentation.dto;

import com.phillippitts.denoisebatch.domain.OutputOptions;

public record OutputOptionsRequest(
        String format,
        Boolean preserveVideo,
        Boolean normalizeLoudness,
        Double targetLufs,
        Integer sampleRate
) {

    public OutputOptions toOptions() {
        OutputOptions d = OutputOptions.defaults();
        return new OutputOptions(
                format,
                preserveVideo != null ? preserveVideo : d.preserveVideo(),
                normalizeLoudness != null ? normalizeLoudness : d.normalizeLoudness(),
                targetLufs != null ? targetLufs : d.targetLufs(),
                sampleRate);
    }
}
