/*
 * Copyright [2013-2016] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.scorebin.core.binning.obj;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.collections.CollectionUtils;
import org.apache.commons.lang.StringUtils;

/**
 * Categorical bin, a group of category values.
 */
public final class CategoricalBinInfo extends AbstractBinInfo {

    public static final char CATEGORY_SEPARATOR = '^';

    private final Set<String> values;

    public CategoricalBinInfo(Collection<String> values) {
        if(CollectionUtils.isEmpty(values)) {
            throw new IllegalArgumentException("CategoricalBinInfo should contain at least one category.");
        }
        this.values = Collections.unmodifiableSet(new LinkedHashSet<String>(values));
    }

    public Set<String> getValues() {
        return values;
    }

    @Override
    public CategoricalBinInfo mergeRight(AbstractBinInfo next) {
        if(!(next instanceof CategoricalBinInfo)) {
            throw new IllegalArgumentException("CategoricalBinInfo could only be merged with CategoricalBinInfo.");
        }
        List<String> union = new ArrayList<String>(this.values);
        union.addAll(((CategoricalBinInfo) next).getValues());
        return new CategoricalBinInfo(union);
    }

    @Override
    public boolean isCategorical() {
        return true;
    }

    @Override
    public String getLabel() {
        return "{" + StringUtils.join(values, CATEGORY_SEPARATOR) + "}";
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj) {
            return true;
        }
        return (obj instanceof CategoricalBinInfo) && values.equals(((CategoricalBinInfo) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }
}
