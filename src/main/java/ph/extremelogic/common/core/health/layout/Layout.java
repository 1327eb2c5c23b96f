package ph.extremelogic.common.core.health.layout;

import ph.extremelogic.common.core.health.SinkEvent;

public interface Layout<T> {
    T toSerializable(SinkEvent event);
    String getContentType();
}
