package com.pocketledger.mail;

import com.pocketledger.domain.User;
import com.pocketledger.security.JwtTokenProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Sends the e-mail verification link after registration.
 *
 * Fire-and-forget: runs on the async executor, and delivery failures are
 * logged, never propagated to the registration request.
 */
@Component
public class VerificationMailer {

    private static final Logger log = LoggerFactory.getLogger(VerificationMailer.class);

    private final JavaMailSender mailSender;
    private final JwtTokenProvider tokenProvider;
    private final String from;
    private final String baseUrl;

    public VerificationMailer(JavaMailSender mailSender,
                              JwtTokenProvider tokenProvider,
                              @Value("${pocketledger.mail.from}") String from,
                              @Value("${pocketledger.mail.verification-base-url}") String baseUrl) {
        this.mailSender = mailSender;
        this.tokenProvider = tokenProvider;
        this.from = from;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Async
    public void sendVerificationEmail(User user) {
        String link = verificationLink(user.getEmail());

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(user.getEmail());
        message.setSubject("Confirm your e-mail address");
        message.setText("Hello " + user.getName() + ",\n\n"
                + "Please confirm your e-mail address by opening the link below:\n"
                + link + "\n\n"
                + "The link is valid for 24 hours.");

        try {
            mailSender.send(message);
            log.info("Verification e-mail sent - userId={}", user.getId());
        } catch (MailException e) {
            log.error("Verification e-mail could not be sent - userId={}", user.getId(), e);
        }
    }

    String verificationLink(String email) {
        return baseUrl + "/auth/verify?token=" + tokenProvider.generateVerificationToken(email);
    }
}
