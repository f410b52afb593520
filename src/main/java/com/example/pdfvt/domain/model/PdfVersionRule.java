package com.example.pdfvt.domain.model;

import java.util.Objects;

/**
 * Constraint a variant places on the document's declared PDF version ({@code "major.minor"}).
 */
public interface PdfVersionRule {

	/**
	 * @param declaredVersion normalized version read from the document, may be {@code null}
	 * @return {@code true} when the declared version satisfies the rule
	 */
    boolean isSatisfiedBy(String declaredVersion);

	/**
	 * @return short label used in diagnostics, e.g. {@code PDF 1.6+}
	 */
    String describe();

    static PdfVersionRule atLeast(int major, int minor) {
        return new AtLeast(major, minor);
    }

    static PdfVersionRule exactly(String version) {
        return new ExactlyEquals(version);
    }

    /**
     * Satisfied by the given version or any later one. A higher major version always satisfies the rule.
     */
    record AtLeast(int major, int minor) implements PdfVersionRule {

        @Override
        public boolean isSatisfiedBy(String declaredVersion) {
            if (declaredVersion == null) {
                return false;
            }
            String[] parts = declaredVersion.trim().split("\\.");
            if (parts.length < 2) {
                return false;
            }
            try {
                int declaredMajor = Integer.parseInt(parts[0]);
                int declaredMinor = Integer.parseInt(parts[1]);
                return declaredMajor > major || (declaredMajor == major && declaredMinor >= minor);
            } catch (NumberFormatException ex) {
                return false;
            }
        }

        @Override
        public String describe() {
            return "PDF " + major + "." + minor + "+";
        }
    }

    /**
     * Satisfied only by the exact version string; later versions fail as well.
     */
    record ExactlyEquals(String version) implements PdfVersionRule {

        public ExactlyEquals {
            Objects.requireNonNull(version, "version");
        }

        @Override
        public boolean isSatisfiedBy(String declaredVersion) {
            return version.equals(declaredVersion);
        }

        @Override
        public String describe() {
            return "PDF " + version;
        }
    }
}
