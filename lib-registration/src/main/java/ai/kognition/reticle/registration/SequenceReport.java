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

package ai.kognition.reticle.registration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One {@link FrameOutcome} per frame of a run, in sequence order.
 */
public class SequenceReport {
    private final List<FrameOutcome> outcomes;

    public SequenceReport(final List<FrameOutcome> outcomes) {
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    public List<FrameOutcome> outcomes() {
        return outcomes;
    }

    public List<FrameOutcome> failures() {
        return outcomes.stream().filter(o -> !o.succeeded()).collect(Collectors.toList());
    }

    public int succeededCount() {
        return (int)outcomes.stream().filter(FrameOutcome::succeeded).count();
    }

    public boolean allSucceeded() {
        return outcomes.stream().allMatch(FrameOutcome::succeeded);
    }

    @Override
    public String toString() {
        return "SequenceReport [" + succeededCount() + " of " + outcomes.size() + " frames registered]";
    }
}
