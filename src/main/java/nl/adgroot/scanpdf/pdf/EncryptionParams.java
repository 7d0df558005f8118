package nl.adgroot.scanpdf.pdf;

import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;

/**
 * Password protection and the permissions granted to a user who opens the document
 * with the user password.
 */
public record EncryptionParams(
    boolean encryptPdf,
    String ownerPassword,
    String userPassword,
    boolean allowPrinting,
    boolean allowFullQualityPrinting,
    boolean allowDocumentModification,
    boolean allowContentCopying,
    boolean allowContentCopyingForAccessibility,
    boolean allowAnnotations,
    boolean allowFormFilling,
    boolean allowDocumentAssembly
) {

  private static final int KEY_LENGTH = 128;

  public EncryptionParams {
    ownerPassword = ownerPassword == null ? "" : ownerPassword;
    userPassword = userPassword == null ? "" : userPassword;
  }

  public static EncryptionParams none() {
    return new EncryptionParams(false, "", "", true, true, true, true, true, true, true, true);
  }

  /** Encrypted, every permission granted. */
  public static EncryptionParams withPasswords(String ownerPassword, String userPassword) {
    return new EncryptionParams(true, ownerPassword, userPassword, true, true, true, true, true, true, true, true);
  }

  /** Encryption only happens when it is switched on and at least one password is set. */
  public boolean isEffective() {
    return encryptPdf && (!ownerPassword.isEmpty() || !userPassword.isEmpty());
  }

  /** Password that grants full access to the encrypted document. */
  public String editPassword() {
    return ownerPassword.isEmpty() ? userPassword : ownerPassword;
  }

  public StandardProtectionPolicy toProtectionPolicy() {
    AccessPermission ap = new AccessPermission();
    ap.setCanPrint(allowPrinting);
    ap.setCanPrintFaithful(allowFullQualityPrinting);
    ap.setCanModify(allowDocumentModification);
    ap.setCanExtractContent(allowContentCopying);
    ap.setCanExtractForAccessibility(allowContentCopyingForAccessibility);
    ap.setCanModifyAnnotations(allowAnnotations);
    ap.setCanFillInForm(allowFormFilling);
    ap.setCanAssembleDocument(allowDocumentAssembly);

    StandardProtectionPolicy policy = new StandardProtectionPolicy(editPassword(), userPassword, ap);
    policy.setEncryptionKeyLength(KEY_LENGTH);
    policy.setPreferAES(true);
    return policy;
  }
}
