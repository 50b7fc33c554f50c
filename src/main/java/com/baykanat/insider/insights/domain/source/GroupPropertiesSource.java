package com.baykanat.insider.insights.domain.source;

import java.util.Map;

/** Group (şirket, proje vb.) property'leri; bulunamazsa boş map. */
public interface GroupPropertiesSource {

    Map<String, Object> groupProperties(long teamId, int groupTypeIndex, String groupKey);
}
