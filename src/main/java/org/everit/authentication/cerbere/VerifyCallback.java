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
package org.everit.authentication.cerbere;

import javax.servlet.http.HttpServletRequest;

import org.everit.authentication.cerbere.profile.Profile;

/**
 * Looks up or creates the application user of an authenticated Cerbere subject. The
 * implementation must call {@link VerifyDone#done(Exception, Object, Object)} exactly once,
 * before returning.
 */
@FunctionalInterface
public interface VerifyCallback {

  /**
   * Invoked instead of {@link #verify(String, Profile, VerifyDone)} if the
   * <code>passReqToCallback</code> option is set. Delegates to
   * {@link #verify(String, Profile, VerifyDone)} by default.
   */
  default void verify(final HttpServletRequest request, final String subjectId,
      final Profile profile, final VerifyDone done) throws Exception {
    verify(subjectId, profile, done);
  }

  /**
   * Verifies the authenticated subject.
   *
   * @param subjectId
   *          the id of the profile
   * @param profile
   *          the normalized profile of the subject
   * @param done
   *          the completion callback
   */
  void verify(String subjectId, Profile profile, VerifyDone done) throws Exception;

}
