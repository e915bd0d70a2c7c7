package io.controlplane.component.server;

import io.controlplane.component.Component;

import java.util.List;

/**
 * The component holding cluster state, and the API server flags that point at it.
 */
public interface StorageBackend extends Component {

    StorageType getType();

    List<String> apiServerArgs();
}
