package com.feedbackinsights.feedback;

import java.io.IOException;
import java.util.List;

import com.feedbackinsights.runtime.RunContext;

public interface FeedbackRecordSource {
    List<FeedbackRecord> loadComplete(RunContext context, RecordFilter filter) throws IOException;

    default List<FeedbackRecord> loadComplete(RunContext context) throws IOException {
        return loadComplete(context, RecordFilter.none());
    }
}
