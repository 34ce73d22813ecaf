package com.questrail.tilemap.tools;

import com.questrail.tilemap.storage.otbm.report.LoadReport;
import com.questrail.tilemap.storage.otbm.report.SaveReport;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a conversion: the load report, and the save report when the
 * load succeeded.
 */
public record ConversionResult(LoadReport load, Optional<SaveReport> save)
{
    public ConversionResult {
        Objects.requireNonNull(load, "load");
        Objects.requireNonNull(save, "save");
    }

    public boolean success() {
        return load.success() && save.map(SaveReport::success).orElse(false);
    }
}
