package com.evaluate.mockinterview.gateway;

import com.evaluate.mockinterview.domain.AudioFeatures;

public interface AudioFeatureExtractor {

    AudioFeatures extract(byte[] audio);
}
