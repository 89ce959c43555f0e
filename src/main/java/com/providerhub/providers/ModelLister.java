package com.providerhub.providers;

import java.util.List;

@FunctionalInterface
public interface ModelLister {
    List<ModelInfo> listModels();
}
