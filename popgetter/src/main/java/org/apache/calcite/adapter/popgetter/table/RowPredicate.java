/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.popgetter.table;

/**
 * Boolean test over one row of a {@link Table}, bound to that table's column
 * positions. Implementations must not modify the array they are given.
 */
@FunctionalInterface
public interface RowPredicate {
  RowPredicate ALWAYS = row -> true;

  boolean test(Object[] row);

  default RowPredicate and(RowPredicate other) {
    return row -> test(row) && other.test(row);
  }

  default RowPredicate or(RowPredicate other) {
    return row -> test(row) || other.test(row);
  }
}
