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

import java.util.Objects;

/** Name and type of one column of a {@link Table}. */
public final class Column {
  private final String name;
  private final DataType type;

  public Column(String name, DataType type) {
    this.name = Objects.requireNonNull(name, "name");
    this.type = Objects.requireNonNull(type, "type");
  }

  public static Column of(String name, DataType type) {
    return new Column(name, type);
  }

  public String name() {
    return name;
  }

  public DataType type() {
    return type;
  }

  public Column withName(String newName) {
    return new Column(newName, type);
  }

  public Column withType(DataType newType) {
    return new Column(name, newType);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Column)) {
      return false;
    }
    Column that = (Column) o;
    return name.equals(that.name) && type == that.type;
  }

  @Override public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override public String toString() {
    return name + ":" + type;
  }
}
