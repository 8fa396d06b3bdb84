package com.microtrader.scanner;

import com.microtrader.domain.model.Instrument;
import com.microtrader.domain.model.MarketFeatures;
import lombok.Value;

@Value
public class ScanResult {

    Instrument instrument;
    MarketFeatures features;
}
