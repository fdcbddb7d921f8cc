package xyz.jphil.profile_resume.model;

public record CertificateEntry(String name, String issuer, String date, String url) {

    public CertificateEntry {
        name = Fields.text(name);
        issuer = Fields.text(issuer);
        date = Fields.text(date);
        url = Fields.text(url);
    }

    public static CertificateEntry named(String name) {
        return new CertificateEntry(name, "", "", "");
    }
}
