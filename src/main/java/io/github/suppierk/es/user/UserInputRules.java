/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.es.user;

import java.util.List;
import java.util.regex.Pattern;

/** Shape checks of user input shared by user command handlers. */
final class UserInputRules {
  private static final Pattern USER_NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");
  private static final int USER_NAME_MIN_LENGTH = 3;
  private static final int USER_NAME_MAX_LENGTH = 50;
  private static final int EMAIL_MAX_LENGTH = 100;

  private UserInputRules() {
    // No instance
  }

  static void checkUserName(final String userName, final List<String> problems) {
    if (userName == null || userName.isBlank()) {
      problems.add("Username is required");
      return;
    }

    if (userName.length() < USER_NAME_MIN_LENGTH) {
      problems.add("Username must be at least 3 characters");
    }

    if (userName.length() > USER_NAME_MAX_LENGTH) {
      problems.add("Username cannot exceed 50 characters");
    }

    if (!USER_NAME_PATTERN.matcher(userName).matches()) {
      problems.add("Username can only contain letters, numbers, underscores, and hyphens");
    }
  }

  static void checkEmail(
      final String email, final boolean limitLength, final List<String> problems) {
    if (email == null || email.isBlank()) {
      problems.add("Email is required");
      return;
    }

    if (!isEmailAddress(email)) {
      problems.add("Invalid email format");
    }

    if (limitLength && email.length() > EMAIL_MAX_LENGTH) {
      problems.add("Email cannot exceed 100 characters");
    }
  }

  /** Exactly one {@code @}, neither first nor last. */
  static boolean isEmailAddress(final String email) {
    final int at = email.indexOf('@');
    return at > 0 && at != email.length() - 1 && at == email.lastIndexOf('@');
  }
}
