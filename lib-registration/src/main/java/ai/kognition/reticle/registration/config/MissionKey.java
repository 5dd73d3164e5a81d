/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.reticle.registration.config;

import java.util.Locale;
import java.util.Objects;

/**
 * Identifies one camera of one mission, for example Ranger 7 channel A.
 */
public final class MissionKey implements Comparable<MissionKey> {
    public final int mission;
    public final String channel;

    public MissionKey(final int mission, final String channel) {
        if(channel == null || channel.trim().isEmpty())
            throw new IllegalArgumentException("A mission key needs a channel.");
        this.mission = mission;
        this.channel = channel.trim().toUpperCase(Locale.ROOT);
    }

    public static MissionKey of(final int mission, final String channel) {
        return new MissionKey(mission, channel);
    }

    /**
     * The prefix of this mission's entries in the configuration properties.
     */
    public String section() {
        return "mission." + mission + "." + channel;
    }

    @Override
    public int compareTo(final MissionKey o) {
        final int byMission = Integer.compare(mission, o.mission);
        return byMission != 0 ? byMission : channel.compareTo(o.channel);
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj)
            return true;
        if(!(obj instanceof MissionKey))
            return false;
        final MissionKey o = (MissionKey)obj;
        return mission == o.mission && channel.equals(o.channel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mission, channel);
    }

    @Override
    public String toString() {
        return "" + mission + channel;
    }
}
