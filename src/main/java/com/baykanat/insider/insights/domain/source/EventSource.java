package com.baykanat.insider.insights.domain.source;

import com.baykanat.insider.insights.domain.model.RawEvent;

import java.util.stream.Stream;

/** Ham event okuma portu. Sıralama yalnızca actor içinde garanti edilir; stream çağıran tarafından kapatılır. */
public interface EventSource {

    Stream<RawEvent> query(EventQuery query);
}
