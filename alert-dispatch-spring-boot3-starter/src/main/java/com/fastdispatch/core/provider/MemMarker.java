package com.fastdispatch.core.provider;

import com.fastdispatch.core.spi.Marker;
import com.fastdispatch.model.Fingerprint;

import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class MemMarker implements Marker {

    private final Map<Fingerprint, Long> silenced = new ConcurrentHashMap<>();

    private final Set<Fingerprint> inhibited = ConcurrentHashMap.newKeySet();

    @Override
    public OptionalLong silenced(Fingerprint fp) {
        Long sid = silenced.get(fp);
        return sid == null ? OptionalLong.empty() : OptionalLong.of(sid);
    }

    @Override
    public boolean inhibited(Fingerprint fp) {
        return inhibited.contains(fp);
    }

    /** sid 为 0 表示解除静默 */
    public void setSilenced(Fingerprint fp, long sid) {
        if (sid == 0) {
            silenced.remove(fp);
        } else {
            silenced.put(fp, sid);
        }
    }

    public void setInhibited(Fingerprint fp, boolean value) {
        if (value) {
            inhibited.add(fp);
        } else {
            inhibited.remove(fp);
        }
    }
}
