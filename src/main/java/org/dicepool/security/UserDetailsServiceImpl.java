package org.dicepool.security;

import org.dicepool.model.Utilisateur;
import org.dicepool.repo.UtilisateurRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.core.userdetails.*;
import org.springframework.stereotype.Service;

@Service
public class UserDetailsServiceImpl implements UserDetailsService {

    @Autowired
    private UtilisateurRepository utilisateurRepo;

    @Override
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        Utilisateur u = utilisateurRepo.findByEmail(username)
                .orElseThrow(() -> new UsernameNotFoundException("Utilisateur non trouvé"));

        String role = (u.getRole() != null && !u.getRole().isBlank()) ? u.getRole() : "USER";

        return User.withUsername(u.getEmail())
                .password(u.getMotDePasseHash())
                .disabled(!u.isActive())
                .roles(role)
                .build();
    }
}
