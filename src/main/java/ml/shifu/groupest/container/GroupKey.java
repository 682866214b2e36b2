/*
 * Copyright [2012-2014] PayPal Software Foundation
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
package ml.shifu.groupest.container;

import com.google.common.base.Joiner;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered list of category values which identifies one group. Components are compared with their own
 * {@link Object#equals(Object)}: floating point values compare exactly and boxed numbers of different types
 * (Integer 1 and Long 1) are different keys.
 */
public final class GroupKey {

    private final List<Object> values;

    private final int hash;

    private GroupKey(List<Object> values) {
        this.values = values;
        this.hash = values.hashCode();
    }

    public static GroupKey of(Object... values) {
        return of(Arrays.asList(values));
    }

    /**
     * Copy values into a new key; null components are allowed.
     */
    public static GroupKey of(List<?> values) {
        // ImmutableList rejects nulls
        return new GroupKey(Collections.unmodifiableList(Arrays.asList(values.toArray())));
    }

    public List<Object> getValues() {
        return values;
    }

    public Object get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof GroupKey)) {
            return false;
        }
        GroupKey other = (GroupKey) o;
        return hash == other.hash && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "(" + Joiner.on(", ").useForNull("null").join(values) + ")";
    }

}
