/*
 * Copyright (C) 2011 Everit Kft. (http://www.everit.biz)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.everit.authentication.cerbere.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The outcome of a service ticket validation as reported by the Cerbere server. A successful
 * result holds the subject identifier and the attributes of the subject, a failed result holds
 * the error code and message sent by the server.
 */
public final class ValidationResult {

  /**
   * Creates a failed result.
   */
  public static ValidationResult failure(final String code, final String message) {
    return new ValidationResult(false, null, Collections.emptyMap(), code, message);
  }

  /**
   * Creates a successful result.
   *
   * @param subjectId
   *          the identifier of the authenticated subject, cannot be <code>null</code>
   * @param attributes
   *          the attributes of the subject. The order of the keys and values is kept.
   */
  public static ValidationResult success(final String subjectId,
      final Map<String, List<String>> attributes) {
    Objects.requireNonNull(subjectId, "subjectId cannot be null");
    Map<String, List<String>> copy = new LinkedHashMap<>();
    for (Map.Entry<String, List<String>> attribute : attributes.entrySet()) {
      copy.put(attribute.getKey(),
          Collections.unmodifiableList(new ArrayList<>(attribute.getValue())));
    }
    return new ValidationResult(true, subjectId, Collections.unmodifiableMap(copy), null, null);
  }

  private final Map<String, List<String>> attributes;

  private final String code;

  private final String message;

  private final String subjectId;

  private final boolean success;

  private ValidationResult(final boolean success, final String subjectId,
      final Map<String, List<String>> attributes, final String code, final String message) {
    this.success = success;
    this.subjectId = subjectId;
    this.attributes = attributes;
    this.code = code;
    this.message = message;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ValidationResult)) {
      return false;
    }
    ValidationResult other = (ValidationResult) obj;
    return (success == other.success) && Objects.equals(subjectId, other.subjectId)
        && attributes.equals(other.attributes) && Objects.equals(code, other.code)
        && Objects.equals(message, other.message);
  }

  /**
   * The attributes of the subject. Empty in case of failed results.
   */
  public Map<String, List<String>> getAttributes() {
    return attributes;
  }

  public String getCode() {
    return code;
  }

  public String getMessage() {
    return message;
  }

  public String getSubjectId() {
    return subjectId;
  }

  @Override
  public int hashCode() {
    return Objects.hash(success, subjectId, attributes, code, message);
  }

  public boolean isSuccess() {
    return success;
  }

  @Override
  public String toString() {
    if (success) {
      return "ValidationResult [success=true, subjectId=" + subjectId + ", attributes="
          + attributes.keySet() + "]";
    }
    return "ValidationResult [success=false, code=" + code + ", message=" + message + "]";
  }

}
