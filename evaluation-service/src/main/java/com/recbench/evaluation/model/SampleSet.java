package com.recbench.evaluation.model;

import com.recbench.evaluation.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Validated, read-only batch of samples shared by every worker of a run.
 */
public final class SampleSet implements Iterable<Sample> {
    private final List<Sample> samples;

    private SampleSet(List<Sample> samples) {
        this.samples = Collections.unmodifiableList(samples);
    }

    public static SampleSet of(List<Sample> rows) {
        return of(rows, null);
    }

    /**
     * @param limit optional truncation applied after validation; ignored when null or non-positive
     */
    public static SampleSet of(List<Sample> rows, Integer limit) {
        if (rows == null || rows.isEmpty()) {
            throw new ValidationException("sample set is empty");
        }
        List<Sample> copy = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Sample sample = rows.get(i);
            if (sample == null) {
                throw new ValidationException("sample at index " + i + " is null");
            }
            copy.add(sample);
        }
        if (limit != null && limit > 0 && limit < copy.size()) {
            copy = new ArrayList<>(copy.subList(0, limit));
        }
        return new SampleSet(copy);
    }

    public Sample get(int index) {
        return samples.get(index);
    }

    public int size() {
        return samples.size();
    }

    public List<Sample> asList() {
        return samples;
    }

    @Override
    public Iterator<Sample> iterator() {
        return samples.iterator();
    }
}
